/**
 * REST endpoints under {@code /api}.
 */
package com.phillippitts.mcphub.presentation.controller;
