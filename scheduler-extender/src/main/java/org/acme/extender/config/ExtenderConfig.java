package org.acme.extender.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.time.Duration;

@ConfigMapping(prefix = "scheduler-extender")
public interface ExtenderConfig {

    @WithDefault("dev")
    String version();

    Index index();

    GroupScore groupScore();

    interface Index {

        @WithDefault("24H")
        Duration resyncPeriod();

        @WithDefault("5M")
        Duration syncTimeout();
    }

    interface GroupScore {

        @WithDefault("group")
        String labelKey();

        @WithDefault("Scale")
        String labelValue();

        @WithDefault("1000")
        int maxScore();
    }
}
