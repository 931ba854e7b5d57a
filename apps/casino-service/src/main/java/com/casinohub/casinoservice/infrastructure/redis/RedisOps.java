package com.casinohub.casinoservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * 公用 Redis 工具类：
 * - 封装常用 String/Hash/Key 操作，值统一为字符串（JSON 由仓储层用 fastjson2 处理）
 * - 仅提供“原语级”方法；业务键名与字段名放在 Repo 层组织
 */
@RequiredArgsConstructor
public class RedisOps {

    private final StringRedisTemplate strRedis;

    // -------------- String --------------
    /**
     * 写入键值（带 TTL）
     */
    public boolean setEx(String key, String val, Duration ttl) {
        strRedis.opsForValue().set(key, val, ttl);
        return true;
    }

    public String get(String key) {
        return strRedis.opsForValue().get(key);
    }

    // -------------- Hash --------------
    public boolean hSet(String key, String field, String val) {
        strRedis.opsForHash().put(key, field, val);
        return true;
    }

    /**
     * 获取整个 Hash（转为 Map<String,String>）
     */
    public Map<String, String> hGetAll(String key) {
        Map<Object, Object> raw = strRedis.opsForHash().entries(key);
        Map<String, String> out = new HashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), String.valueOf(v)));
        return out;
    }

    public Long hDel(String key, String... fields) {
        return strRedis.opsForHash().delete(key, (Object[]) fields);
    }

    // -------------- Key & TTL --------------
    public Boolean expire(String key, Duration ttl) {
        return strRedis.expire(key, ttl);
    }

    /**
     * 删除一个或多个 Key
     */
    public Long del(String... keys) {
        return strRedis.delete(Arrays.asList(keys));
    }
}
