package me.internalizable.lodestone.daemon.auth;

import me.internalizable.lodestone.api.error.ErrorKind;
import me.internalizable.lodestone.api.error.LodestoneException;
import me.internalizable.lodestone.api.instance.InstanceUuid;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link User} permission checks.
 */
class UserTest {

    private final InstanceUuid granted = InstanceUuid.generate();
    private final InstanceUuid other = InstanceUuid.generate();

    private static User user(UserPermission permission) {
        return new User("uid-1", "alice", false, false, permission);
    }

    @Nested
    @DisplayName("regular users")
    class RegularUsers {

        @Test
        @DisplayName("instance actions follow the per-instance sets")
        void instanceActionsFollowSets() {
            UserPermission permission = new UserPermission();
            permission.getCanViewInstance().add(granted.value());
            User user = user(permission);

            assertTrue(user.canPerform(UserAction.viewInstance(granted)));
            assertFalse(user.canPerform(UserAction.viewInstance(other)));
            assertFalse(user.canPerform(UserAction.readInstanceFile(granted)));
        }

        @Test
        @DisplayName("ownership grant covers every instance action")
        void ownershipGrant() {
            UserPermission permission = new UserPermission();
            permission.grantInstanceOwnership(granted);
            User user = user(permission);

            assertTrue(user.canPerform(UserAction.viewInstance(granted)));
            assertTrue(user.canPerform(UserAction.startInstance(granted)));
            assertTrue(user.canPerform(UserAction.stopInstance(granted)));
            assertTrue(user.canPerform(UserAction.readInstanceFile(granted)));
            assertTrue(user.canPerform(UserAction.writeInstanceFile(granted)));
            assertFalse(user.canPerform(UserAction.deleteInstance()));
        }

        @Test
        @DisplayName("global actions follow the booleans")
        void globalActionsFollowBooleans() {
            UserPermission permission = new UserPermission();
            permission.setCanCreateInstance(true);
            User user = user(permission);

            assertTrue(user.canPerform(UserAction.createInstance()));
            assertFalse(user.canPerform(UserAction.deleteInstance()));
            assertFalse(user.canPerform(UserAction.managePermission()));
        }

        @Test
        @DisplayName("tryAction throws FORBIDDEN")
        void tryActionThrowsForbidden() {
            User user = user(new UserPermission());
            LodestoneException e = assertThrows(LodestoneException.class,
                    () -> user.tryAction(UserAction.deleteInstance()));
            assertEquals(ErrorKind.FORBIDDEN, e.getKind());
        }

        @Test
        @DisplayName("later changes to the source record do not leak into the user")
        void snapshotIsIndependent() {
            UserPermission permission = new UserPermission();
            User user = user(permission);
            permission.setCanDeleteInstance(true);

            assertFalse(user.canPerform(UserAction.deleteInstance()));
        }
    }

    @Test
    @DisplayName("owners may do everything")
    void ownersMayDoEverything() {
        User owner = new User("uid-0", "root", true, false, new UserPermission());
        assertTrue(owner.canPerform(UserAction.managePermission()));
        assertTrue(owner.canPerform(UserAction.writeInstanceFile(other)));
    }

    @Test
    @DisplayName("admins may do everything but manage permissions")
    void adminsMayNotManagePermissions() {
        User admin = new User("uid-2", "mod", false, true, new UserPermission());
        assertTrue(admin.canPerform(UserAction.deleteInstance()));
        assertTrue(admin.canPerform(UserAction.viewInstance(other)));
        assertFalse(admin.canPerform(UserAction.managePermission()));
    }

    @Test
    @DisplayName("instance actions require an instance")
    void instanceActionsRequireInstance() {
        assertThrows(IllegalArgumentException.class,
                () -> new UserAction(UserAction.Kind.VIEW_INSTANCE, null));
    }
}
