package org.hpcbench.deploy;

/**
 * Renders scheduler batch scripts. Templating is supplied by the caller; the rendered job must
 * write its hostname to {@link ScriptContext#endpointMarkerPath()} once it has started.
 */
public interface JobScriptRenderer {
    String renderServiceScript(ServiceSpec spec, ScriptContext context);

    String renderClientScript(ClientSpec spec, ScriptContext context);
}
