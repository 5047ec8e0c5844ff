/**
 * Component graph engine.
 *
 * <p>A {@link com.phillippitts.mcphub.service.graph.GraphDefinition} declares nodes and
 * conditional edges; {@link com.phillippitts.mcphub.service.graph.ComponentGraph} validates
 * it against registered {@link com.phillippitts.mcphub.service.graph.PipelineComponent}s
 * and runs it over a fresh {@link com.phillippitts.mcphub.service.graph.PipelineState}.
 * Nodes run strictly one after another on the calling thread.
 */
package com.phillippitts.mcphub.service.graph;
