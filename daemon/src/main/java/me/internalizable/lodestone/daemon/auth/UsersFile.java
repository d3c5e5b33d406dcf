package me.internalizable.lodestone.daemon.auth;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk shape of {@code users.yml}.
 */
public class UsersFile {

    private List<UserEntry> users = new ArrayList<>();

    public List<UserEntry> getUsers() {
        return users;
    }

    public void setUsers(List<UserEntry> users) {
        this.users = users != null ? users : new ArrayList<>();
    }

    /**
     * One user record, token included.
     */
    public static class UserEntry {

        private String uid;
        private String username;
        private String token;
        private boolean owner;
        private boolean admin;
        private UserPermission permissions = new UserPermission();

        public UserEntry() {
        }

        public UserEntry(String uid, String username, String token, boolean owner, boolean admin,
                         UserPermission permissions) {
            this.uid = uid;
            this.username = username;
            this.token = token;
            this.owner = owner;
            this.admin = admin;
            this.permissions = permissions;
        }

        UserEntry copy() {
            return new UserEntry(uid, username, token, owner, admin, permissions.copy());
        }

        User toUser() {
            return new User(uid, username, owner, admin, permissions);
        }

        // Getters and Setters

        public String getUid() {
            return uid;
        }

        public void setUid(String uid) {
            this.uid = uid;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public boolean isOwner() {
            return owner;
        }

        public void setOwner(boolean owner) {
            this.owner = owner;
        }

        public boolean isAdmin() {
            return admin;
        }

        public void setAdmin(boolean admin) {
            this.admin = admin;
        }

        public UserPermission getPermissions() {
            return permissions;
        }

        public void setPermissions(UserPermission permissions) {
            this.permissions = permissions != null ? permissions : new UserPermission();
        }
    }
}
