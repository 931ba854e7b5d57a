package com.casinohub.casinoservice.games.casino.domain.model;

import java.util.List;

/**
 * 一轮结束时的计分结果，seats 下标与座位一致。
 */
public record RoundResult(int round, List<SeatScore> seats) {

    public RoundResult {
        seats = List.copyOf(seats);
    }

    public int totalOf(int seat) {
        return seats.get(seat).total();
    }
}
