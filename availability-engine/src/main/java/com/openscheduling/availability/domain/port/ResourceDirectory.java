package com.openscheduling.availability.domain.port;

import java.util.List;

/**
 * Lists the schedulable resources searched when a request does not name any.
 */
public interface ResourceDirectory {

    /**
     * @return ids of all active resources, sorted
     */
    List<String> listResourceIds();
}
