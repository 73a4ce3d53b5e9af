// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.


package org.warden.auth.plugin.jwt;

import org.warden.auth.WardenConfig;
import org.warden.auth.WardenException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Signing key material persisted as a JSON document in a file readable and writable by its
 * owner only.
 *
 * <p>{@link #loadOrCreate(SigningKeys.Algorithm)} runs once at startup, before the keys are
 * shared: it reads the file if present, otherwise generates keys and publishes the file with
 * {@code rw-------} permissions before returning them.
 */
public class SigningKeyFile {

    private static final Logger LOG = LogManager.getLogger(SigningKeyFile.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    static final Set<PosixFilePermission> OWNER_ONLY =
            EnumSet.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE);

    private final Path path;

    public SigningKeyFile(Path path) {
        this.path = Objects.requireNonNull(path, "path is required");
    }

    public Path getPath() {
        return path;
    }

    /**
     * Loads the key file, or generates and saves new keys if it does not exist. An empty file,
     * left behind by an interrupted write of an older version, is replaced.
     *
     * @param algorithm configured algorithm
     * @return key material
     * @throws WardenException INTERNAL on I/O failure or unreadable keys, CONVERSION if the
     *         file holds keys for a different algorithm
     */
    public SigningKeys loadOrCreate(SigningKeys.Algorithm algorithm) throws WardenException {
        boolean replaceEmpty = false;
        if (Files.exists(path)) {
            if (!isEmpty()) {
                return load(algorithm);
            }
            LOG.warn("Signing key file {} is empty, generating new keys", path);
            replaceEmpty = true;
        }
        SigningKeys keys = SigningKeys.generate(algorithm);
        try {
            write(keys, replaceEmpty);
        } catch (WardenException e) {
            if (e.getCause() instanceof FileAlreadyExistsException) {
                // created concurrently by another process; use its keys
                return load(algorithm);
            }
            throw e;
        }
        LOG.info("Generated new {} signing keys at {}", algorithm, path);
        return keys;
    }

    private SigningKeys load(SigningKeys.Algorithm algorithm) throws WardenException {
        SigningKeys keys = load();
        if (keys.getAlgorithm() != algorithm) {
            throw WardenException.conversion(WardenConfig.TOKEN_ALGORITHM,
                    "key file " + path + " holds " + keys.getAlgorithm() + " keys but " + algorithm
                            + " is configured");
        }
        return keys;
    }

    /**
     * Reads the key file.
     *
     * @return key material
     * @throws WardenException INTERNAL if the file cannot be read or parsed
     */
    public SigningKeys load() throws WardenException {
        SigningKeyDocument document;
        try {
            warnIfReadableByOthers();
            document = JSON_MAPPER.readValue(path.toFile(), SigningKeyDocument.class);
        } catch (IOException e) {
            throw WardenException.internal("failed to read signing key file " + path, e);
        }
        SigningKeys keys = SigningKeys.fromDocument(document);
        LOG.info("Loaded {} signing keys from {}", keys.getAlgorithm(), path);
        return keys;
    }

    /**
     * Writes the keys to a new key file with owner-only permissions. Fails if the file already
     * exists.
     *
     * <p>The document is written and flushed to a temporary file in the same directory, which is
     * then linked into place, so the key file is either absent or complete.
     *
     * @param keys key material
     * @throws WardenException INTERNAL on I/O failure, with a {@link FileAlreadyExistsException}
     *         cause if the file exists
     */
    public void save(SigningKeys keys) throws WardenException {
        write(keys, false);
    }

    private void write(SigningKeys keys, boolean replace) throws WardenException {
        Path temp = null;
        try {
            Path parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            String prefix = "." + path.getFileName() + ".";
            if (supportsPosix()) {
                temp = Files.createTempFile(parent, prefix, ".tmp", PosixFilePermissions.asFileAttribute(OWNER_ONLY));
            } else {
                LOG.warn("File system of {} has no POSIX permissions; signing keys are not owner-restricted", path);
                temp = Files.createTempFile(parent, prefix, ".tmp");
            }
            byte[] content = JSON_MAPPER.writeValueAsBytes(keys.toDocument());
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            if (replace) {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE);
            } else {
                publish(temp);
            }
        } catch (IOException e) {
            throw WardenException.internal("failed to write signing key file " + path, e);
        } finally {
            deleteTemp(temp);
        }
    }

    /**
     * Links the complete temporary file into place; unlike a rename this never replaces a file
     * another process published first.
     */
    private void publish(Path temp) throws IOException {
        try {
            Files.createLink(path, temp);
        } catch (UnsupportedOperationException e) {
            Files.move(temp, path);
        }
    }

    private void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Failed to delete temporary key file {}", temp, e);
        }
    }

    private boolean isEmpty() throws WardenException {
        try {
            return Files.size(path) == 0;
        } catch (IOException e) {
            throw WardenException.internal("failed to read signing key file " + path, e);
        }
    }

    private boolean supportsPosix() {
        Path parent = path.toAbsolutePath().getParent();
        return parent != null && Files.getFileAttributeView(parent, PosixFileAttributeView.class) != null;
    }

    private void warnIfReadableByOthers() throws IOException {
        if (!supportsPosix()) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(path);
        if (!OWNER_ONLY.containsAll(permissions)) {
            LOG.warn("Signing key file {} has permissions {}, expected {}", path,
                    PosixFilePermissions.toString(permissions), PosixFilePermissions.toString(OWNER_ONLY));
        }
    }
}
