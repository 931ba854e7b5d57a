package com.casinohub.casinoservice.games.casino.domain.action;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 客户端提交的走法描述（未校验）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MoveDescriptor {

    public enum Kind { CAPTURE, BUILD, TRAIL }

    private Kind kind;
    private String cardId;
    private List<String> targets = new ArrayList<>();
    private Integer declaredValue;

    public static MoveDescriptor capture(String cardId, String... targets) {
        return new MoveDescriptor(Kind.CAPTURE, cardId, List.of(targets), null);
    }

    public static MoveDescriptor build(String cardId, int declaredValue, String... targets) {
        return new MoveDescriptor(Kind.BUILD, cardId, List.of(targets), declaredValue);
    }

    public static MoveDescriptor trail(String cardId) {
        return new MoveDescriptor(Kind.TRAIL, cardId, List.of(), null);
    }

    /**
     * 结构校验并转换为规范走法（不涉及规则）。
     *
     * @throws IllegalArgumentException 缺少必填字段或 id 重复
     */
    public Move toMove(String playerId) {
        if (kind == null) {
            throw new IllegalArgumentException("move kind is required");
        }
        List<String> ids = targets == null ? List.of() : targets;
        if (ids.stream().anyMatch(StringUtils::isBlank)) {
            throw new IllegalArgumentException("blank target id");
        }
        if (ids.stream().distinct().count() != ids.size()) {
            throw new IllegalArgumentException("duplicate target id");
        }
        if (kind != Kind.BUILD && StringUtils.isBlank(cardId)) {
            throw new IllegalArgumentException("cardId is required");
        }
        return switch (kind) {
            case CAPTURE -> new CaptureMove(playerId, cardId, ids);
            case TRAIL -> {
                if (!ids.isEmpty()) {
                    throw new IllegalArgumentException("trail takes no targets");
                }
                yield new TrailMove(playerId, cardId);
            }
            case BUILD -> {
                if (declaredValue == null) {
                    throw new IllegalArgumentException("declaredValue is required");
                }
                yield new BuildMove(playerId, StringUtils.trimToNull(cardId), ids, declaredValue);
            }
        };
    }
}
