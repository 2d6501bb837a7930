/*
 * © Copyright Databand.ai, an IBM Company 2024
 */

package io.tabula;

import io.tabula.config.TabulaConfig;
import org.slf4j.Logger;

/**
 * Thin SLF4J wrapper which tags engine messages and gates verbose output on tabula.core.verbose.
 */
public class TabulaLog {

    public static final String LOG_PREFIX = "[tabula] ";

    private final Logger LOG;

    public TabulaLog(final Logger logger) {
        this.LOG = logger;
    }

    public void warn(final String msg, final Object... args) {
        LOG.warn(LOG_PREFIX + msg, args);
    }

    public void debug(final String msg, final Object... args) {
        if (LOG.isDebugEnabled()) {
            LOG.debug(LOG_PREFIX + msg, args);
        }
    }

    public void verbose(final String msg, final Object... args) {
        if (TabulaConfig.global().isVerbose()) {
            LOG.info(LOG_PREFIX + "v " + msg, args);
        }
    }
}
