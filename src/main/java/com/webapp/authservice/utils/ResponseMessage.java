package com.webapp.authservice.utils;

import java.lang.annotation.*;

/**
 * Message placed in the success envelope for a controller or one of its handlers.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ResponseMessage {
    String value() default "OK";
}
