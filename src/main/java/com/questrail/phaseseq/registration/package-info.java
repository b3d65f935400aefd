/**
 * Registration Boundary
 * =============================================================================
 *
 * <p>Image registration runs in an external Fiji process; this package starts
 * it, bounds it in time and turns its console log into a shift report.</p>
 *
 * <pre>
 *   composed stack
 *        → RegistrationTool            (aligned stack + raw log)
 *        → RegistrationLogTranslator   (SIFT parameters + "tx,ty" per transition)
 * </pre>
 *
 * <p>Nothing here interprets pixels. The shift values keep the tool's own
 * decimal text.</p>
 */
package com.questrail.phaseseq.registration;
