/**
 * Built-in pipeline components for meeting follow-up, email reply and knowledge Q&amp;A.
 * Each is a Spring bean registered in the catalog under its {@code NAME}.
 */
package com.phillippitts.mcphub.service.component;
