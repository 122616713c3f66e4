package com.baton.core.model;

import com.baton.core.marker.MarkerBlock;

/**
 * A status event together with one structured block found in it.
 *
 * @param index position of the event in the work item's comment list
 */
public record MarkedEvent(StatusEvent event, MarkerBlock block, int index) {}
