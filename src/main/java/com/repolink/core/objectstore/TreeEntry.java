package com.repolink.core.objectstore;

/**
 * One entry of a tree object to be created over a base tree.
 *
 * @param path repository-relative path
 * @param mode git file mode, {@code 100644} for a regular file
 * @param type object type, {@code blob} for file content
 * @param sha  sha of the referenced object
 */
public record TreeEntry(String path, String mode, String type, String sha) {

    public static final String REGULAR_FILE_MODE = "100644";
    public static final String BLOB_TYPE = "blob";

    public static TreeEntry regularFile(String path, String blobSha) {
        return new TreeEntry(path, REGULAR_FILE_MODE, BLOB_TYPE, blobSha);
    }
}
