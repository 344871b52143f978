package com.ddm.rhea.exceptions;

/**
 * 配置相关异常的基类。所有配置异常均为非受检异常。
 *
 * @author liyifei
 * @since 1.0
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
