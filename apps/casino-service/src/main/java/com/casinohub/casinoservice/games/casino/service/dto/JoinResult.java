package com.casinohub.casinoservice.games.casino.service.dto;

import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;

/**
 * 建房/入座结果。
 *
 * @param roomId 房间 ID
 * @param token  新签发的会话令牌
 * @param seat   座位号（0 或 1）
 * @param state  入座后的房间快照
 */
public record JoinResult(String roomId, String token, int seat, CasinoState state) {
}
