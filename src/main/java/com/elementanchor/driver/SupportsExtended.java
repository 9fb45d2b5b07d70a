package com.elementanchor.driver;

import com.elementanchor.model.Operation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares which extended operation forms a {@link NodeBinding} implementation accepts.
 *
 * The {@link CapabilityProbe} reads this declaration (through
 * {@link NodeBinding#capabilities()}) before any extended-argument call is dispatched.
 * A binding class without the annotation supports the minimal forms only.
 *
 * <pre>
 *   {@literal @}SupportsExtended({Operation.CLICK, Operation.DOUBLE_CLICK})
 *   public class MyBrowserNode implements NodeBinding { ... }
 * </pre>
 *
 * Rules:
 *   - Every operation listed must have its extended method overridden; the NodeBinding
 *     defaults raise NOT_SUPPORTED.
 *   - The declaration is inherited by subclasses unless they declare their own.
 */
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface SupportsExtended {
    Operation[] value();
}
