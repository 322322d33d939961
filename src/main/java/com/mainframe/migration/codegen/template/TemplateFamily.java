package com.mainframe.migration.codegen.template;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Template sets available for generated code, selected by the target-stack hint.
 *
 * Only the plain Java family exists today. Every hint resolves to it; the
 * lookup is the seam for stack-specific template sets.
 */
public enum TemplateFamily {

    JAVA("java");

    private static final Logger log = LoggerFactory.getLogger(TemplateFamily.class);

    private final String directory;

    TemplateFamily(String directory) {
        this.directory = directory;
    }

    /**
     * Classpath directory below /templates.
     */
    public String getDirectory() {
        return directory;
    }

    public String templatePath(String templateName) {
        return directory + "/" + templateName;
    }

    public static TemplateFamily forTargetStack(String targetStack) {
        if (targetStack != null) {
            String hint = targetStack.trim().toLowerCase(Locale.ROOT);
            for (TemplateFamily family : values()) {
                if (family.directory.equals(hint)) {
                    return family;
                }
            }
            log.debug("No dedicated templates for target stack '{}', using {}", targetStack, JAVA);
        }
        return JAVA;
    }
}
