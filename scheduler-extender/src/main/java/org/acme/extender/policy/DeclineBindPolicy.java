package org.acme.extender.policy;

import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import org.acme.extender.dto.ExtenderBindingArgs;

/**
 * This extender only filters and scores. A bind request reaching it means the scheduler's
 * extender registration still routes the bind verb here, so it is refused loudly.
 */
@ApplicationScoped
public class DeclineBindPolicy implements BindPolicy {

    static final String MESSAGE = "This extender doesn't support Bind. Please make 'BindVerb' be empty in your ExtenderConfig.";

    @Override
    public void bind(ExtenderBindingArgs args) {
        if (args == null) {
            Log.warn("Refusing bind request without arguments");
        } else {
            Log.warnf("Refusing bind of %s/%s to node %s", args.podNamespace(), args.podName(), args.node());
        }
        throw new BindingNotSupportedException(MESSAGE);
    }
}
