package com.ryuqq.graphics.adapter.inmemory.entity;

import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.EntityHandle;
import com.ryuqq.graphics.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory 엔티티 데이터베이스.
 *
 * <p>문서 하나에 해당하며, 핸들 할당과 엔티티 저장을 담당합니다.
 * 엔티티는 레이아웃({@link InMemoryLayout})을 통해 추가됩니다.</p>
 *
 * <p><strong>자료 구조:</strong></p>
 * <ul>
 *   <li><strong>entities:</strong> ConcurrentHashMap&lt;EntityHandle, StoredEntity&gt; - 핸들 조회 (O(1))</li>
 *   <li><strong>layouts:</strong> ConcurrentHashMap&lt;String, InMemoryLayout&gt; - 소유자 이름별 레이아웃</li>
 * </ul>
 *
 * <p><strong>핸들 할당:</strong> {@link AtomicLong} 시퀀스, 16진수 문자열로 변환
 * (첫 핸들은 {@value #FIRST_HANDLE}의 16진수 표현).</p>
 *
 * <p><strong>제약 사항:</strong></p>
 * <ul>
 *   <li>프로세스 재시작 시 데이터 유실</li>
 *   <li>DXF 파일 입출력 없음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * InMemoryEntityDatabase database = new InMemoryEntityDatabase();
 * InMemoryLayout modelSpace = database.modelSpace();
 * EntityHandle handle = modelSpace.create(EntityKind.LINE, attributes);
 * StoredEntity line = database.find(handle).orElseThrow();
 * </pre>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public class InMemoryEntityDatabase {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEntityDatabase.class);

    /**
     * 모델 공간 레이아웃 이름.
     */
    public static final String MODEL_SPACE = "*Model_Space";

    /**
     * 첫 엔티티 핸들 번호 (테이블 핸들 영역 이후).
     */
    public static final long FIRST_HANDLE = 0x30;

    private final ConcurrentHashMap<EntityHandle, StoredEntity> entities;
    private final ConcurrentHashMap<String, InMemoryLayout> layouts;
    private final AtomicLong handleSequence;

    public InMemoryEntityDatabase() {
        this.entities = new ConcurrentHashMap<>();
        this.layouts = new ConcurrentHashMap<>();
        this.handleSequence = new AtomicLong(FIRST_HANDLE);
    }

    /**
     * 모델 공간 레이아웃.
     *
     * @return 모델 공간
     */
    public InMemoryLayout modelSpace() {
        return layout(MODEL_SPACE);
    }

    /**
     * 이름으로 레이아웃 조회 (없으면 생성).
     *
     * @param owner 레이아웃 이름
     * @return 레이아웃
     * @throws IllegalArgumentException owner가 null 또는 빈 문자열인 경우
     */
    public InMemoryLayout layout(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner cannot be null or blank");
        }
        return layouts.computeIfAbsent(owner, name -> new InMemoryLayout(this, name));
    }

    /**
     * 엔티티 저장.
     *
     * @param kind 엔티티 종류
     * @param attributes 엔티티 속성
     * @param owner 소유 레이아웃 이름
     * @return 저장된 엔티티
     */
    StoredEntity store(EntityKind kind, AttributeSet attributes, String owner) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (attributes == null) {
            throw new IllegalArgumentException("attributes cannot be null");
        }
        EntityHandle handle = EntityHandle.of(handleSequence.getAndIncrement());
        StoredEntity entity = new StoredEntity(handle, kind, attributes, owner);
        entities.put(handle, entity);
        log.debug("Stored {} {} in {}", kind.getDxfType(), handle.getValue(), owner);
        return entity;
    }

    public Optional<StoredEntity> find(EntityHandle handle) {
        if (handle == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entities.get(handle));
    }

    /**
     * 핸들로 엔티티 조회.
     *
     * @param handle 엔티티 핸들
     * @return 저장된 엔티티
     * @throws IllegalArgumentException 엔티티가 없는 경우
     */
    public StoredEntity get(EntityHandle handle) {
        return find(handle).orElseThrow(
            () -> new IllegalArgumentException("Entity not found: " + handle)
        );
    }

    public int size() {
        return entities.size();
    }

    /**
     * 모든 엔티티와 레이아웃 삭제 (핸들 시퀀스는 유지).
     */
    public void clear() {
        entities.clear();
        layouts.values().forEach(InMemoryLayout::clear);
        layouts.clear();
    }
}
