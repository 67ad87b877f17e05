package com.phillippitts.docingest.domain;

/**
 * A user-selected file as handed to the coordinator.
 *
 * @param name display name as selected (may carry OS copy suffixes or percent-encoding)
 * @param size byte size reported by the selection; negative when unknown
 * @param content file bytes
 */
public record SubmittedFile(String name, long size, byte[] content) {

    public static SubmittedFile of(String name, byte[] content) {
        return new SubmittedFile(name, content == null ? -1 : content.length, content);
    }
}
