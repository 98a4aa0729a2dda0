package de.bsommerfeld.workbench.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Selects the collaborators the workspace layer runs against. PROD reads
 * projects.json, spawns git and reads session indexes; TEST serves a generated
 * workspace from memory and never touches disk or starts processes.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Mode from the {@code app.mode} system property, else the {@code APP_MODE}
     * environment variable, else PROD.
     */
    public static ApplicationMode get() {
        return resolve(System.getProperty("app.mode"), System.getenv("APP_MODE"));
    }

    /**
     * @param property value of {@code app.mode}, may be {@code null}
     * @param env      value of {@code APP_MODE}, may be {@code null}
     * @return the first non-blank value as a mode; PROD if both are blank or the
     *         chosen value names no mode
     */
    static ApplicationMode resolve(String property, String env) {
        String value = isBlank(property) ? env : property;
        if (isBlank(value))
            return PROD;

        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', falling back to PROD", value);
            return PROD;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public boolean isTest() {
        return this == TEST;
    }
}
