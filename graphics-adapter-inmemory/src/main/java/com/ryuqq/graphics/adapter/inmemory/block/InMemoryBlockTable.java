package com.ryuqq.graphics.adapter.inmemory.block;

import com.ryuqq.graphics.adapter.inmemory.entity.InMemoryEntityDatabase;
import com.ryuqq.graphics.adapter.inmemory.entity.InMemoryLayout;
import com.ryuqq.graphics.adapter.inmemory.entity.StoredEntity;
import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.EntityKind;
import com.ryuqq.graphics.core.model.Point3;
import com.ryuqq.graphics.core.spi.BlockTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link BlockTable} 구현.
 *
 * <p>블록마다 기준점과 레이아웃을 가지며, 블록의 속성 정의는 해당 레이아웃에
 * 추가된 ATTDEF 엔티티입니다. 반환되는 정의에는 ATTDEF의 {@code handle}이 포함됩니다.</p>
 *
 * <p><strong>익명 블록:</strong> {@code *U1}, {@code *U2}, ... 순서로 할당하며
 * 기준점은 원점입니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public class InMemoryBlockTable implements BlockTable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBlockTable.class);

    private static final String ANONYMOUS_PREFIX = "*U";

    private final InMemoryEntityDatabase database;
    private final ConcurrentHashMap<String, Point3> basePoints;
    private final AtomicInteger anonymousCounter;

    /**
     * 생성자.
     *
     * @param database 블록 엔티티를 저장할 데이터베이스
     * @throws IllegalArgumentException database가 null인 경우
     */
    public InMemoryBlockTable(InMemoryEntityDatabase database) {
        if (database == null) {
            throw new IllegalArgumentException("database cannot be null");
        }
        this.database = database;
        this.basePoints = new ConcurrentHashMap<>();
        this.anonymousCounter = new AtomicInteger();
    }

    /**
     * 새 블록 정의.
     *
     * @param name 블록 이름
     * @param basePoint 기준점
     * @return 블록 레이아웃 (엔티티 추가용)
     * @throws IllegalArgumentException 이름이 비어있거나 이미 존재하는 경우
     */
    public InMemoryLayout defineBlock(String name, Point3 basePoint) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (basePoint == null) {
            throw new IllegalArgumentException("basePoint cannot be null");
        }
        if (basePoints.putIfAbsent(name, basePoint) != null) {
            throw new IllegalArgumentException("Block already exists: " + name);
        }
        log.debug("Defined block {} at {}", name, basePoint);
        return database.layout(name);
    }

    @Override
    public boolean contains(String name) {
        return name != null && basePoints.containsKey(name);
    }

    @Override
    public List<AttributeSet> attributeDefinitions(String name) {
        List<AttributeSet> definitions = new ArrayList<>();
        for (StoredEntity attdef : layout(name).entities(EntityKind.ATTDEF)) {
            definitions.add(attdef.attributes().with("handle", attdef.handle().getValue()));
        }
        return Collections.unmodifiableList(definitions);
    }

    @Override
    public Point3 basePoint(String name) {
        requireBlock(name);
        return basePoints.get(name);
    }

    @Override
    public String newAnonymousBlock() {
        String name;
        do {
            name = ANONYMOUS_PREFIX + anonymousCounter.incrementAndGet();
        } while (basePoints.putIfAbsent(name, Point3.ORIGIN) != null);
        log.debug("Allocated anonymous block {}", name);
        return name;
    }

    @Override
    public InMemoryLayout layout(String name) {
        requireBlock(name);
        return database.layout(name);
    }

    public int size() {
        return basePoints.size();
    }

    private void requireBlock(String name) {
        if (!contains(name)) {
            throw new IllegalArgumentException("Block not found: " + name);
        }
    }
}
