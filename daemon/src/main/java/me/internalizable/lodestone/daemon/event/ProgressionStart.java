package me.internalizable.lodestone.daemon.event;

/**
 * A freshly built start event together with the id its end event must reuse.
 *
 * @param event the start event
 * @param eventId the allocated id
 */
public record ProgressionStart(ProgressionEvent event, long eventId) {
}
