package com.questrail.msgrpc.handler;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as an RPC handler for
 * {@link HandlerRegistry#registerAnnotated(Object)}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface RpcMethod
{
    /** Wire method name; defaults to the Java method name. */
    String value() default "";
}
