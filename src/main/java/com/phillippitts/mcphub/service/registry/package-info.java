/**
 * Service registry: the single, atomically swappable catalog of capability chains,
 * components and graphs, and its construction from configuration at startup.
 */
package com.phillippitts.mcphub.service.registry;
