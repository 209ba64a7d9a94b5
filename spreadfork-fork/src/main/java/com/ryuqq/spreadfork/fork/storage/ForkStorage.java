package com.ryuqq.spreadfork.fork.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/**
 * Filesystem operations used by the fork registry and its guards.
 *
 * <p>Every method that touches the disk declares {@link IOException}; the registry wraps
 * those into {@code IoFailureException} with the operation name. Implementations must be
 * thread-safe.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 * @see LocalForkStorage
 */
public interface ForkStorage {

    /**
     * Copies {@code source} to {@code target}, replacing it and creating parent directories.
     *
     * @param source existing file
     * @param target destination file
     * @throws IOException if the copy fails
     */
    void copy(Path source, Path target) throws IOException;

    /**
     * Moves a fully written file over {@code target} in one step, so readers observe
     * either the old or the new content.
     *
     * @param staged fully written file
     * @param target destination file
     * @throws IOException if the move fails
     */
    void promote(Path staged, Path target) throws IOException;

    /**
     * @param path file to delete
     * @return true if a file was deleted
     * @throws IOException if the file exists but cannot be deleted
     */
    boolean deleteIfExists(Path path) throws IOException;

    /**
     * @param dir directory to create with its parents
     * @throws IOException if creation fails
     */
    void createDirectories(Path dir) throws IOException;

    boolean exists(Path path);

    long size(Path path) throws IOException;

    FileTime lastModified(Path path) throws IOException;

    /**
     * @param path file to hash
     * @return lowercase hex SHA-256 of the file content
     * @throws IOException if the file cannot be read
     */
    String digest(Path path) throws IOException;

    /**
     * @param path file to read
     * @param length maximum number of leading bytes
     * @return up to {@code length} leading bytes
     * @throws IOException if the file cannot be read
     */
    byte[] readHeader(Path path, int length) throws IOException;
}
