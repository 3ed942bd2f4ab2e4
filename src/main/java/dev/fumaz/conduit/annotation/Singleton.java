package dev.fumaz.conduit.annotation;

import java.lang.annotation.*;

/**
 * Marks a class as a singleton. Bindings to an annotated implementation default to an
 * injector-wide singleton, or to a process-wide one when {@link #global()} is set.
 */
@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Singleton {

    boolean global() default false;

}
