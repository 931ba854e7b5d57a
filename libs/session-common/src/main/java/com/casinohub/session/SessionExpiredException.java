package com.casinohub.session;

import lombok.Getter;

/**
 * 会话已失效：令牌不存在、已被顶替、已关闭或心跳超时。
 */
@Getter
public class SessionExpiredException extends RuntimeException {

    private final String token;

    public SessionExpiredException(String token, String message) {
        super(message);
        this.token = token;
    }
}
