package com.casinohub.casinoservice.games.casino.room;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;
import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * 状态校验和：规范化 JSON（字段有序、保留 null）的 SHA-256 十六进制串。
 * 与版本号一起下发，客户端据此判断本地状态是否与服务端一致。
 */
public final class StateChecksum {

    private StateChecksum() {
    }

    public static String of(CasinoState state) {
        return DigestUtils.sha256Hex(canonicalJson(state));
    }

    static String canonicalJson(CasinoState state) {
        return JSON.toJSONString(state, JSONWriter.Feature.MapSortField, JSONWriter.Feature.WriteNulls);
    }
}
