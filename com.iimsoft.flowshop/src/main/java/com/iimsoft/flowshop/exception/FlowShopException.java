package com.iimsoft.flowshop.exception;

/**
 * 所有核心错误的基类。消息里带上出错的组件和输入，调用方据此定位问题；
 * 核心不做任何自动重试。
 */
public class FlowShopException extends RuntimeException {

    private final String component;

    public FlowShopException(String component, String message) {
        super(component + ": " + message);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
