/**
 * HTTP boundary. Controllers delegate to the task manager and registry; exception handlers
 * translate domain errors. Presentation depends on service, never the reverse.
 */
package com.phillippitts.mcphub.presentation;
