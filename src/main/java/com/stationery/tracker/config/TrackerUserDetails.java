package com.stationery.tracker.config;

import com.stationery.tracker.service.Actor;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.User;

import java.util.List;

public class TrackerUserDetails extends User {

    private final Long userId;

    public TrackerUserDetails(com.stationery.tracker.model.User user) {
        super(user.getUsername(), user.getPassword(), user.isActive(), true, true, true,
                List.of(new SimpleGrantedAuthority("ROLE_" + user.getRole().name())));
        this.userId = user.getId();
    }

    public Long getUserId() {
        return userId;
    }

    public Actor toActor() {
        return new Actor(userId, getUsername());
    }
}
