package dev.directives.engine;

/**
 * What the rewrite pass does with one classified function.
 */
public enum Strategy {
    /** Keep the body in place, strip the directive and register it at the end of the module. */
    REGISTER_IN_PLACE,
    /** Move the body to module level under a generated name and leave a reference behind. */
    HOIST_AND_REFERENCE,
    /** Replace the function with a call into the step runtime. */
    PROXY,
    /** Keep the body, drop the directive, emit nothing else. */
    STRIP_DIRECTIVE,
    /** Keep the body, drop the directive, attach the id and add it to the workflow registry. */
    REGISTER_WORKFLOW,
    /** Replace the body with a throwing stub and attach the id. */
    THROW_STUB
}
