package com.modelgate.promotion;

import java.io.IOException;

import com.modelgate.registry.ModelVersion;

/**
 * Tells the serving layer to pick up a newly promoted version.
 */
public interface ReloadNotifier {
    boolean isEnabled();

    /**
     * Sends one notification and returns the HTTP status the serving layer answered with.
     */
    int notifyReload(ModelVersion promoted) throws IOException;

    static ReloadNotifier disabled() {
        return new ReloadNotifier() {
            @Override
            public boolean isEnabled() {
                return false;
            }

            @Override
            public int notifyReload(ModelVersion promoted) {
                throw new IllegalStateException("reload notification is disabled");
            }
        };
    }
}
