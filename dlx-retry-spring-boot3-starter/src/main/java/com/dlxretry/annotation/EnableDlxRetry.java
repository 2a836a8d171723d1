package com.dlxretry.annotation;

import java.lang.annotation.*;

/**
 * 标注在配置类上, 控制消费者是否随容器自动启动
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnableDlxRetry {

    /**
     * 是否启动
     */
    boolean value() default true;
}
