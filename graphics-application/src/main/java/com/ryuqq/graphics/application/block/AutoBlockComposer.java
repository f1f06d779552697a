package com.ryuqq.graphics.application.block;

import com.ryuqq.graphics.core.attribute.AttributeAssembler;
import com.ryuqq.graphics.core.exception.DxfValueException;
import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.EntityHandle;
import com.ryuqq.graphics.core.model.EntityKind;
import com.ryuqq.graphics.core.model.Point3;
import com.ryuqq.graphics.core.spi.BlockTable;
import com.ryuqq.graphics.core.spi.EntityCreator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 속성 자동 채움 블록 참조 조립기.
 *
 * <p>블록에 정의된 ATTDEF마다 ATTRIB을 하나씩 만들어 새 익명 블록에 넣고,
 * 그 익명 블록에 대한 참조 요청을 반환합니다.</p>
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>블록 존재 확인 (없으면 아무것도 생성하지 않고 실패)</li>
 *   <li>익명 블록 할당</li>
 *   <li>익명 블록에 원본 블록의 INSERT를 원점에 생성</li>
 *   <li>ATTDEF마다 ATTRIB 생성 (prompt, handle 제외, 값은 valueByTag 또는 "")</li>
 *   <li>익명 블록에 대한 {@link BlockReferenceRequest} 반환</li>
 * </ol>
 *
 * <p>ATTRIB의 insert는 ATTDEF의 insert에서 블록 기준점을 뺀 값입니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public class AutoBlockComposer {

    private static final Logger log = LoggerFactory.getLogger(AutoBlockComposer.class);

    private final BlockTable blocks;

    public AutoBlockComposer(BlockTable blocks) {
        if (blocks == null) {
            throw new IllegalArgumentException("blocks cannot be null");
        }
        this.blocks = blocks;
    }

    /**
     * 익명 블록을 조립하고 참조 요청을 반환.
     *
     * @param name 원본 블록 이름
     * @param insert 최종 삽입점 (WCS)
     * @param valueByTag tag → 값 (null 가능, 없는 tag는 "")
     * @param overrides 최종 INSERT 추가 속성 (null 가능)
     * @return 익명 블록에 대한 참조 요청
     * @throws IllegalArgumentException name 또는 insert가 null인 경우
     * @throws DxfValueException 블록이 없거나 ATTDEF에 tag가 없는 경우
     */
    public BlockReferenceRequest compose(String name, Point3 insert, Map<String, String> valueByTag,
                                         AttributeSet overrides) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (insert == null) {
            throw new IllegalArgumentException("insert cannot be null");
        }
        if (!blocks.contains(name)) {
            throw new DxfValueException("name", "undefined block: " + name);
        }
        Map<String, String> values = valueByTag == null ? Map.of() : valueByTag;
        List<AttributeSet> definitions = blocks.attributeDefinitions(name);
        for (AttributeSet definition : definitions) {
            if (definition.getString("tag") == null) {
                throw new DxfValueException("tag", "attribute definition without tag in block " + name);
            }
        }
        Point3 basePoint = blocks.basePoint(name);

        String anonymousBlock = blocks.newAnonymousBlock();
        EntityCreator layout = blocks.layout(anonymousBlock);
        AttributeSet.Builder insertAttributes = AttributeSet.builder()
            .put("name", name)
            .put("insert", Point3.ORIGIN);
        if (!definitions.isEmpty()) {
            insertAttributes.put("attribs_follow", 1);
        }
        EntityHandle blockRef = layout.create(
            EntityKind.INSERT, AttributeAssembler.assemble(EntityKind.INSERT, null, insertAttributes.build())
        );

        List<AttributeSet> attribs = new ArrayList<>(definitions.size());
        for (AttributeSet definition : definitions) {
            AttributeSet attrib = toAttrib(definition, basePoint, values, blockRef);
            layout.create(EntityKind.ATTRIB, attrib);
            attribs.add(attrib);
        }
        log.debug("Composed auto block {} for block {} with {} attribs", anonymousBlock, name, attribs.size());
        return new BlockReferenceRequest(anonymousBlock, insert, overrides, attribs);
    }

    private static AttributeSet toAttrib(AttributeSet definition, Point3 basePoint, Map<String, String> values,
                                         EntityHandle owner) {
        String tag = definition.getString("tag");
        Point3 definitionInsert = definition.getPoint("insert");
        Point3 offset = (definitionInsert == null ? Point3.ORIGIN : definitionInsert).subtract(basePoint);
        AttributeSet copied = definition
            .without("prompt")
            .without("handle")
            .without("tag")
            .without("insert");
        AttributeSet computed = AttributeSet.builder()
            .put("tag", tag)
            .put("text", values.getOrDefault(tag, ""))
            .put("insert", offset)
            .put("owner", owner.getValue())
            .build();
        return AttributeAssembler.assemble(EntityKind.ATTRIB, copied, computed);
    }
}
