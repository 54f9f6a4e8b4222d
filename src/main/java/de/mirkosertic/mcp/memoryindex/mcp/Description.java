package de.mirkosertic.mcp.memoryindex.mcp;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Human readable text for a tool argument. {@link SchemaGenerator} copies it into the JSON schema that
 * clients use to fill in the arguments.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface Description {

    String value();
}
