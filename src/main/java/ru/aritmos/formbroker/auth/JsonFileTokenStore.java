package ru.aritmos.formbroker.auth;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.formbroker.config.FormBrokerProperties;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Хранилище токен-сессий в памяти с сохранением в JSON-файл.
 * <p>
 * При старте файл читается, записи старше {@code formbroker.tokens.max-age-hours} отбрасываются,
 * и файл перезаписывается. Ошибки чтения/записи файла не останавливают сервис: токен-сессии
 * продолжают работать в памяти, пользователю потребуется повторная авторизация после перезапуска.
 */
@Singleton
public class JsonFileTokenStore implements TokenStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileTokenStore.class);

    private static final TypeReference<List<AuthModels.TokenSession>> LIST_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Path file;
    private final Duration maxAge;
    private final Map<String, AuthModels.TokenSession> sessions = new ConcurrentHashMap<>();
    private final Object fileLock = new Object();

    public JsonFileTokenStore(ObjectMapper objectMapper, FormBrokerProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        String storage = properties.getTokens().getStorageFile();
        this.file = storage == null || storage.isBlank() ? null : Path.of(storage.trim());
        this.maxAge = Duration.ofHours(Math.max(1, properties.getTokens().getMaxAgeHours()));
    }

    /**
     * Загрузить токен-сессии из файла.
     *
     * @return количество загруженных сессий
     */
    @PostConstruct
    public int load() {
        if (file == null || !Files.exists(file)) {
            return 0;
        }
        long cutoff = clock.millis() - maxAge.toMillis();
        int loaded = 0;
        int dropped = 0;
        try {
            List<AuthModels.TokenSession> stored = objectMapper.readValue(Files.readString(file), LIST_TYPE);
            for (AuthModels.TokenSession s : stored) {
                if (s == null || s.sessionId() == null || s.tokenData() == null) {
                    dropped++;
                    continue;
                }
                if (s.createdAtEpochMs() < cutoff) {
                    dropped++;
                    continue;
                }
                sessions.put(s.sessionId(), s);
                loaded++;
            }
        } catch (IOException e) {
            log.warn("Не удалось прочитать файл токен-сессий {}: {}", file, e.getMessage());
            return 0;
        }
        log.info("Загружено токен-сессий: {}, отброшено устаревших: {}", loaded, dropped);
        if (dropped > 0) {
            persist();
        }
        return loaded;
    }

    @Override
    public Optional<AuthModels.TokenSession> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Optional<AuthModels.TokenSession> findByContextId(String contextId) {
        if (contextId == null) {
            return Optional.empty();
        }
        return sessions.values().stream()
                .filter(s -> contextId.equals(s.contextId()))
                .max(Comparator.comparingLong(AuthModels.TokenSession::createdAtEpochMs));
    }

    @Override
    public void put(AuthModels.TokenSession session) {
        sessions.put(session.sessionId(), session);
        persist();
    }

    @Override
    public boolean delete(String sessionId) {
        boolean removed = sessions.remove(sessionId) != null;
        if (removed) {
            persist();
        }
        return removed;
    }

    @Override
    public int removeIf(Predicate<AuthModels.TokenSession> condition) {
        AtomicInteger removed = new AtomicInteger();
        sessions.values().removeIf(s -> {
            if (condition.test(s)) {
                removed.incrementAndGet();
                return true;
            }
            return false;
        });
        if (removed.get() > 0) {
            persist();
        }
        return removed.get();
    }

    @Override
    public void touch(String sessionId, long nowEpochMs) {
        sessions.computeIfPresent(sessionId, (id, s) -> s.touch(nowEpochMs));
    }

    @Override
    public List<AuthModels.TokenSession> all() {
        return List.copyOf(sessions.values());
    }

    private void persist() {
        if (file == null) {
            return;
        }
        synchronized (fileLock) {
            try {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
                String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(new ArrayList<>(sessions.values()));
                Files.writeString(tmp, json);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                log.warn("Не удалось сохранить токен-сессии в {}: {}", file, e.getMessage());
            }
        }
    }
}
