package com.ryuqq.graphics.adapter.inmemory.entity;

import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.EntityHandle;
import com.ryuqq.graphics.core.model.EntityKind;
import com.ryuqq.graphics.core.spi.EntityCreator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory 레이아웃 (모델 공간 또는 블록).
 *
 * <p>{@link EntityCreator} 구현으로, 생성된 엔티티를 데이터베이스에 저장하고
 * 생성 순서를 기억합니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public class InMemoryLayout implements EntityCreator {

    private final InMemoryEntityDatabase database;
    private final String name;
    private final List<StoredEntity> entities;

    InMemoryLayout(InMemoryEntityDatabase database, String name) {
        this.database = database;
        this.name = name;
        this.entities = new CopyOnWriteArrayList<>();
    }

    @Override
    public EntityHandle create(EntityKind kind, AttributeSet attributes) {
        StoredEntity entity = database.store(kind, attributes, name);
        entities.add(entity);
        return entity.handle();
    }

    public String getName() {
        return name;
    }

    /**
     * 생성 순서대로 엔티티 목록.
     *
     * @return 불변 목록
     */
    public List<StoredEntity> entities() {
        return Collections.unmodifiableList(new ArrayList<>(entities));
    }

    /**
     * 특정 종류의 엔티티 목록 (생성 순서).
     *
     * @param kind 엔티티 종류
     * @return 불변 목록
     */
    public List<StoredEntity> entities(EntityKind kind) {
        List<StoredEntity> result = new ArrayList<>();
        for (StoredEntity entity : entities) {
            if (entity.kind() == kind) {
                result.add(entity);
            }
        }
        return Collections.unmodifiableList(result);
    }

    public int size() {
        return entities.size();
    }

    void clear() {
        entities.clear();
    }

    @Override
    public String toString() {
        return "InMemoryLayout{" + name + ", entities=" + entities.size() + '}';
    }
}
