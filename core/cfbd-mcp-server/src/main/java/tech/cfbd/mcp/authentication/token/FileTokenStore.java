package tech.cfbd.mcp.authentication.token;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.runtime.Startup;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.cfbd.mcp.authentication.AuthConfig;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Token store backed by a JSON array on disk.
 *
 * <p>The whole set is rewritten on every insertion: serialized to a sibling
 * temp file, flushed to disk, then moved over the store file. Writes are
 * serialized so a slower writer can never replace a newer snapshot.
 *
 * <p>Loaded once at startup. A missing file starts an empty store; an
 * unreadable or corrupt file is logged and also starts empty, so a bad file
 * never stops the service from booting.
 */
@Startup
@Singleton
public class FileTokenStore implements TokenStore {

    private static final Logger LOG = Logger.getLogger(FileTokenStore.class);
    private static final TypeReference<List<String>> TOKEN_LIST = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Supplier<Executor> writeExecutor;
    private final Set<String> tokens = ConcurrentHashMap.newKeySet();
    private final Object writeLock = new Object();

    private volatile boolean persistent;

    @Inject
    public FileTokenStore(AuthConfig authConfig, ObjectMapper objectMapper) {
        this(Path.of(authConfig.tokenStore().file()), objectMapper, Infrastructure::getDefaultWorkerPool);
    }

    FileTokenStore(Path file, ObjectMapper objectMapper, Executor writeExecutor) {
        this(file, objectMapper, () -> writeExecutor);
    }

    /**
     * @param writeExecutor resolved on every write; the worker pool is only
     *                      installed once the runtime has started
     */
    FileTokenStore(Path file, ObjectMapper objectMapper, Supplier<Executor> writeExecutor) {
        this.file = file.toAbsolutePath();
        this.objectMapper = objectMapper;
        this.writeExecutor = writeExecutor;
        load();
    }

    @Override
    public Uni<Void> issue(String token) {
        tokens.add(token);
        return Uni.createFrom().item(() -> {
                persist();
                return (Void) null;
            })
            .runSubscriptionOn(writeExecutor.get());
    }

    @Override
    public boolean contains(String token) {
        return token != null && tokens.contains(token);
    }

    @Override
    public int size() {
        return tokens.size();
    }

    @Override
    public boolean isPersistent() {
        return persistent;
    }

    private void load() {
        if (!Files.exists(file)) {
            LOG.infof("Token store %s does not exist yet, starting empty", file);
            persistent = true;
            return;
        }
        try {
            List<String> stored = objectMapper.readValue(file.toFile(), TOKEN_LIST);
            stored.stream().filter(t -> t != null && !t.isBlank()).forEach(tokens::add);
            persistent = true;
            LOG.infof("Loaded %d issued tokens from %s", tokens.size(), file);
        } catch (IOException | RuntimeException e) {
            persistent = false;
            LOG.errorf(e, "Failed to load issued tokens from %s, starting with an empty store", file);
        }
    }

    private void persist() {
        synchronized (writeLock) {
            List<String> snapshot = new ArrayList<>(tokens);
            Path temp = null;
            try {
                Path dir = file.getParent();
                if (dir != null) {
                    Files.createDirectories(dir);
                }
                temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
                try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                    ByteBuffer buffer = ByteBuffer.wrap(objectMapper.writeValueAsBytes(snapshot));
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                    channel.force(true);
                }
                moveIntoPlace(temp);
                persistent = true;
                LOG.debugf("Persisted %d issued tokens to %s", snapshot.size(), file);
            } catch (IOException | RuntimeException e) {
                persistent = false;
                LOG.errorf(e, "Failed to save issued tokens to %s; tokens remain valid until restart", file);
                deleteQuietly(temp);
            }
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warnf("Could not remove temp token file %s: %s", temp, e.getMessage());
        }
    }
}
