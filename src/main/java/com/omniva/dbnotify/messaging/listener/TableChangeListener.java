package com.omniva.dbnotify.messaging.listener;

import org.springframework.stereotype.Component;

import java.lang.annotation.*;

/**
 * Annotation to automatically subscribe {@link ChangeHandler} beans.
 * <p>
 * TableChangeListener(
 * table = "User",
 * operations = {"INSERT", "DELETE"}
 * )
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface TableChangeListener {

    /**
     * Table name this handler listens to (case-sensitive, as sent by the trigger).
     * Empty means every table.
     */
    String table() default "";

    /**
     * Operations to receive. Empty means every operation.
     * Requires a table.
     */
    String[] operations() default {};

    /**
     * Whether this handler is subscribed at startup
     */
    boolean enabled() default true;
}
