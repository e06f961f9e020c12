package com.ryuqq.gateway.adapter.inmemory;

import com.ryuqq.gateway.core.model.AliasRecord;
import com.ryuqq.gateway.core.model.CollectionConfig;
import com.ryuqq.gateway.core.model.CollectionInfo;
import com.ryuqq.gateway.core.model.CollectionParamsDiff;
import com.ryuqq.gateway.core.model.CollectionStatus;
import com.ryuqq.gateway.core.model.CollectionSummary;
import com.ryuqq.gateway.core.operation.AliasOperation;
import com.ryuqq.gateway.core.operation.ChangeAliasesOperation;
import com.ryuqq.gateway.core.operation.CollectionMetaOperation;
import com.ryuqq.gateway.core.operation.CreateCollectionOperation;
import com.ryuqq.gateway.core.operation.DeleteCollectionOperation;
import com.ryuqq.gateway.core.operation.UpdateCollectionOperation;
import com.ryuqq.gateway.core.outcome.OperationResult;
import com.ryuqq.gateway.core.spi.CoordinatorClient;
import com.ryuqq.gateway.core.spi.CoordinatorErrorKind;
import com.ryuqq.gateway.core.spi.CoordinatorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link CoordinatorClient} SPI for testing and reference purposes.
 *
 * <p>Collections and aliases live in insertion-ordered maps guarded by a single
 * {@link ReadWriteLock}. Every mutation is applied atomically under the write lock.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>collections:</strong> LinkedHashMap&lt;String, CollectionConfig&gt; - Resolved configs by collection name</li>
 *   <li><strong>aliases:</strong> LinkedHashMap&lt;String, String&gt; - Alias name to collection name</li>
 * </ul>
 *
 * <p><strong>Mutation Rules:</strong></p>
 * <ul>
 *   <li>create: name must not be used by a collection or an alias (ALREADY_EXISTS)</li>
 *   <li>update, delete: collection must exist (NOT_FOUND); delete also drops its aliases</li>
 *   <li>change aliases: the whole batch is validated against a working copy and applied only if every action succeeds</li>
 * </ul>
 *
 * <p>Read lookups by name (collection info, collection aliases) accept an alias and resolve it to its collection.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No consensus, no persistence: data lost on process restart</li>
 *   <li>waitTimeout is accepted but never needed, mutations complete immediately</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CoordinatorClient coordinator = new InMemoryCoordinatorClient();
 * CollectionsService service = new DispatchingCollectionsService(coordinator);
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public class InMemoryCoordinatorClient implements CoordinatorClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCoordinatorClient.class);

    private static final int DEFAULT_SHARD_NUMBER = 1;
    private static final int DEFAULT_REPLICATION_FACTOR = 1;
    private static final int DEFAULT_WRITE_CONSISTENCY_FACTOR = 1;

    private final Map<String, CollectionConfig> collections = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Executor executor;

    /**
     * 호출 스레드에서 즉시 완료하는 인스턴스 생성.
     */
    public InMemoryCoordinatorClient() {
        this(Runnable::run);
    }

    /**
     * 지정한 Executor에서 작업을 완료하는 인스턴스 생성.
     *
     * @param executor 작업 실행 Executor
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public InMemoryCoordinatorClient(Executor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
    }

    @Override
    public CompletableFuture<OperationResult> submit(CollectionMetaOperation operation, Optional<Duration> waitTimeout) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (waitTimeout == null) {
            throw new IllegalArgumentException("waitTimeout cannot be null");
        }
        return async(() -> {
            write(() -> apply(operation));
            log.info("Applied {} (waitTimeout={})", operation.kind(), waitTimeout.orElse(null));
            return OperationResult.success();
        });
    }

    @Override
    public CompletableFuture<List<CollectionSummary>> listCollections() {
        return async(() -> read(() -> collections.keySet().stream()
            .map(CollectionSummary::new)
            .toList()));
    }

    @Override
    public CompletableFuture<List<AliasRecord>> listAliases() {
        return async(() -> read(() -> aliases.entrySet().stream()
            .map(entry -> new AliasRecord(entry.getKey(), entry.getValue()))
            .toList()));
    }

    /**
     * 컬렉션의 별칭 목록 조회.
     *
     * <p>이름이 별칭이면 별칭이 가리키는 컬렉션의 별칭 목록을 반환합니다.</p>
     */
    @Override
    public CompletableFuture<List<String>> collectionAliases(String collectionName) {
        return async(() -> read(() -> {
            String resolved = resolve(collectionName);
            requireCollection(resolved);
            return aliases.entrySet().stream()
                .filter(entry -> entry.getValue().equals(resolved))
                .map(Map.Entry::getKey)
                .toList();
        }));
    }

    /**
     * 컬렉션 정보 조회.
     *
     * <p>이름이 별칭이면 별칭이 가리키는 컬렉션의 정보를 반환합니다.</p>
     */
    @Override
    public CompletableFuture<CollectionInfo> getCollectionInfo(String collectionName) {
        return async(() -> read(() -> {
            CollectionConfig config = requireCollection(resolve(collectionName));
            return new CollectionInfo(CollectionStatus.GREEN, 0L, config);
        }));
    }

    /**
     * 모든 컬렉션과 별칭 삭제 (테스트용).
     */
    public void clear() {
        write(() -> {
            collections.clear();
            aliases.clear();
            return null;
        });
    }

    private Void apply(CollectionMetaOperation operation) {
        if (operation instanceof CreateCollectionOperation create) {
            createCollection(create);
        } else if (operation instanceof UpdateCollectionOperation update) {
            updateCollection(update);
        } else if (operation instanceof DeleteCollectionOperation delete) {
            deleteCollection(delete);
        } else if (operation instanceof ChangeAliasesOperation change) {
            changeAliases(change);
        } else {
            throw new CoordinatorException(CoordinatorErrorKind.BAD_REQUEST,
                "Unsupported operation: " + operation.getClass().getSimpleName());
        }
        return null;
    }

    private void createCollection(CreateCollectionOperation operation) {
        String name = operation.collectionName().getValue();
        if (collections.containsKey(name)) {
            throw CoordinatorException.alreadyExists("Collection `" + name + "` already exists!");
        }
        if (aliases.containsKey(name)) {
            throw CoordinatorException.alreadyExists("Alias `" + name + "` already exists!");
        }
        CollectionConfig requested = operation.config();
        collections.put(name, new CollectionConfig(
            requested.vectors(),
            orDefault(requested.shardNumber(), DEFAULT_SHARD_NUMBER),
            orDefault(requested.replicationFactor(), DEFAULT_REPLICATION_FACTOR),
            orDefault(requested.writeConsistencyFactor(), DEFAULT_WRITE_CONSISTENCY_FACTOR),
            requested.onDiskPayload() != null ? requested.onDiskPayload() : Boolean.FALSE
        ));
    }

    private void updateCollection(UpdateCollectionOperation operation) {
        String name = operation.collectionName().getValue();
        CollectionConfig current = requireCollection(name);
        CollectionParamsDiff diff = operation.paramsDiff();
        if (diff.isEmpty()) {
            return;
        }
        collections.put(name, new CollectionConfig(
            current.vectors(),
            current.shardNumber(),
            diff.replicationFactor() != null ? diff.replicationFactor() : current.replicationFactor(),
            diff.writeConsistencyFactor() != null ? diff.writeConsistencyFactor() : current.writeConsistencyFactor(),
            diff.onDiskPayload() != null ? diff.onDiskPayload() : current.onDiskPayload()
        ));
    }

    private void deleteCollection(DeleteCollectionOperation operation) {
        String name = operation.collectionName().getValue();
        requireCollection(name);
        collections.remove(name);
        aliases.values().removeIf(name::equals);
    }

    private void changeAliases(ChangeAliasesOperation operation) {
        Map<String, String> working = new LinkedHashMap<>(aliases);
        for (AliasOperation action : operation.actions()) {
            if (action instanceof AliasOperation.CreateAlias create) {
                String collection = create.collectionName().getValue();
                String alias = create.aliasName().getValue();
                requireCollection(collection);
                if (working.containsKey(alias)) {
                    throw CoordinatorException.alreadyExists("Alias `" + alias + "` already exists!");
                }
                if (collections.containsKey(alias)) {
                    throw CoordinatorException.alreadyExists("Collection `" + alias + "` already exists!");
                }
                working.put(alias, collection);
            } else if (action instanceof AliasOperation.RenameAlias rename) {
                String oldAlias = rename.oldAliasName().getValue();
                String newAlias = rename.newAliasName().getValue();
                String target = working.get(oldAlias);
                if (target == null) {
                    throw CoordinatorException.notFound("Alias `" + oldAlias + "` doesn't exist!");
                }
                if (working.containsKey(newAlias) || collections.containsKey(newAlias)) {
                    throw CoordinatorException.alreadyExists("Alias `" + newAlias + "` already exists!");
                }
                working.remove(oldAlias);
                working.put(newAlias, target);
            } else if (action instanceof AliasOperation.DeleteAlias delete) {
                String alias = delete.aliasName().getValue();
                if (working.remove(alias) == null) {
                    throw CoordinatorException.notFound("Alias `" + alias + "` doesn't exist!");
                }
            }
        }
        aliases.clear();
        aliases.putAll(working);
    }

    private String resolve(String name) {
        return aliases.getOrDefault(name, name);
    }

    private CollectionConfig requireCollection(String name) {
        CollectionConfig config = collections.get(name);
        if (config == null) {
            throw CoordinatorException.notFound("Collection `" + name + "` doesn't exist!");
        }
        return config;
    }

    private static Integer orDefault(Integer value, int defaultValue) {
        return value != null ? value : defaultValue;
    }

    private <T> CompletableFuture<T> async(Supplier<T> work) {
        return CompletableFuture.supplyAsync(work, executor);
    }

    private <T> T read(Supplier<T> work) {
        lock.readLock().lock();
        try {
            return work.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> work) {
        lock.writeLock().lock();
        try {
            return work.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
