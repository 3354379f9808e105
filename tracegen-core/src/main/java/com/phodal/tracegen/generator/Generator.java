package com.phodal.tracegen.generator;

import com.phodal.tracegen.model.Trace;

import java.util.List;

/**
 * Source of freshly generated traces. Every call builds new, fully populated traces.
 */
public interface Generator {

    List<Trace> traces();
}
