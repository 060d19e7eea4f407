package io.templatexform.core.spi;

/** Runtime environment a template output targets. */
public enum TargetRuntime {
    JS,
    PHP
}
