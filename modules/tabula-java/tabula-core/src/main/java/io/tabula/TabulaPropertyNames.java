/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula;

public abstract class TabulaPropertyNames {

    /**
     * Max rows rendered by Series and DataFrame toString(). Default 10.
     */
    public static final String TABULA__DISPLAY__MAX_ROWS = "tabula.display.max_rows";

    /**
     * Suffix appended to colliding left-hand columns on merge. Default "_x".
     */
    public static final String TABULA__MERGE__LEFT_SUFFIX = "tabula.merge.left_suffix";

    /**
     * Suffix appended to colliding right-hand columns on merge. Default "_y".
     */
    public static final String TABULA__MERGE__RIGHT_SUFFIX = "tabula.merge.right_suffix";

    /**
     * Turn on verbose logging of engine operations.
     */
    public static final String TABULA__CORE__VERBOSE = "tabula.core.verbose";

}
