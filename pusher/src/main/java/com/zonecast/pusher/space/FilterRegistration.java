package com.zonecast.pusher.space;

import com.zonecast.core.model.SpaceFilter;
import com.zonecast.core.model.SpaceUser;
import lombok.Getter;

import java.util.HashSet;
import java.util.Set;

/**
 * One named filter of a watcher, with the users it currently lets through.
 */
@Getter
class FilterRegistration {
    private final String name;
    private final SpaceFilter filter;
    private final Set<Long> matched = new HashSet<>();

    FilterRegistration(String name, SpaceFilter filter) {
        this.name = name;
        this.filter = filter;
    }

    boolean matches(SpaceUser user) {
        return filter.matches(user);
    }
}
