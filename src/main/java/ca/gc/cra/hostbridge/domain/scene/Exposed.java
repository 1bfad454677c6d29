package ca.gc.cra.hostbridge.domain.scene;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a non-public component field as externally settable.
 *
 * <p>Autowiring considers public fields first and then fields carrying this annotation. The property bridge
 * can reach any field by name regardless of the annotation.</p>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Exposed {}
