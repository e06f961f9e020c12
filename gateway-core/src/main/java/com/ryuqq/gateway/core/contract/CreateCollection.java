package com.ryuqq.gateway.core.contract;

import com.ryuqq.gateway.core.model.CollectionConfig;
import com.ryuqq.gateway.core.model.CollectionName;
import com.ryuqq.gateway.core.model.Distance;
import com.ryuqq.gateway.core.model.VectorParams;
import com.ryuqq.gateway.core.operation.ConversionResult;
import com.ryuqq.gateway.core.operation.CreateCollectionOperation;
import com.ryuqq.gateway.core.operation.OperationConvertible;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 컬렉션 생성 요청.
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * CreateCollection request = new CreateCollection(
 *     "books",
 *     Map.of("text", new VectorParamsMessage(384L, "Cosine")),
 *     2, 1, null, null,
 *     30L
 * );
 * </pre>
 *
 * @param collectionName 컬렉션 이름
 * @param vectorsConfig 벡터 이름별 파라미터 (null이면 빈 맵, 비어 있으면 변환 시 거부)
 * @param shardNumber 샤드 수 (null 허용)
 * @param replicationFactor 복제 계수 (null 허용)
 * @param writeConsistencyFactor 쓰기 일관성 계수 (null 허용)
 * @param onDiskPayload 페이로드 디스크 저장 여부 (null 허용)
 * @param timeout 대기 타임아웃 초 (null 허용, 음수 불가)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record CreateCollection(
    String collectionName,
    Map<String, VectorParamsMessage> vectorsConfig,
    Integer shardNumber,
    Integer replicationFactor,
    Integer writeConsistencyFactor,
    Boolean onDiskPayload,
    Long timeout
) implements WithTimeout, OperationConvertible {

    public CreateCollection {
        WithTimeout.requireNonNegative(timeout);
        vectorsConfig = vectorsConfig == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(vectorsConfig));
    }

    @Override
    public ConversionResult convert() {
        Optional<String> violation = Conversions.firstViolation(
            Conversions.collectionName(collectionName),
            Conversions.positive("shard_number", shardNumber),
            Conversions.positive("replication_factor", replicationFactor),
            Conversions.positive("write_consistency_factor", writeConsistencyFactor)
        );
        if (violation.isPresent()) {
            return ConversionResult.rejected(violation.get());
        }
        if (vectorsConfig.isEmpty()) {
            return ConversionResult.rejected("vectors config is required");
        }

        Map<String, VectorParams> vectors = new LinkedHashMap<>();
        for (Map.Entry<String, VectorParamsMessage> entry : vectorsConfig.entrySet()) {
            String vectorName = entry.getKey();
            VectorParamsMessage params = entry.getValue();
            if (vectorName == null) {
                return ConversionResult.rejected("vector name cannot be null");
            }
            if (params == null) {
                return ConversionResult.rejected("vector params for '" + vectorName + "' are missing");
            }
            if (params.size() == null || params.size() <= 0) {
                return ConversionResult.rejected(
                    "vector size for '" + vectorName + "' must be positive (current: " + params.size() + ")");
            }
            Optional<Distance> distance = Distance.fromWireName(params.distance());
            if (distance.isEmpty()) {
                return ConversionResult.rejected(
                    "unknown distance for '" + vectorName + "': " + params.distance()
                        + " (expected one of " + Distance.supportedWireNames() + ")");
            }
            vectors.put(vectorName, new VectorParams(params.size(), distance.get()));
        }

        CollectionConfig config = new CollectionConfig(
            vectors, shardNumber, replicationFactor, writeConsistencyFactor, onDiskPayload);
        return ConversionResult.converted(
            new CreateCollectionOperation(CollectionName.of(collectionName), config));
    }
}
