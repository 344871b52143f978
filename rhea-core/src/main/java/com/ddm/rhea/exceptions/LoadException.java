package com.ddm.rhea.exceptions;

/**
 * 提供者加载数据失败。
 *
 * @author liyifei
 * @since 1.0
 */
public class LoadException extends ConfigurationException {

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
