/**
 * Spring configuration: executors, pool metrics and bound properties.
 */
package com.phillippitts.mcphub.config;
