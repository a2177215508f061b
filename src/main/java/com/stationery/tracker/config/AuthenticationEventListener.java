package com.stationery.tracker.config;

import com.stationery.tracker.service.Actor;
import com.stationery.tracker.service.AuditService;
import org.springframework.context.event.EventListener;
import org.springframework.security.authentication.event.AbstractAuthenticationFailureEvent;
import org.springframework.security.authentication.event.AuthenticationSuccessEvent;
import org.springframework.stereotype.Component;

@Component
public class AuthenticationEventListener {

    private final AuditService auditService;

    public AuthenticationEventListener(AuditService auditService) {
        this.auditService = auditService;
    }

    @EventListener
    public void onSuccess(AuthenticationSuccessEvent event) {
        Object principal = event.getAuthentication().getPrincipal();
        Actor actor = principal instanceof TrackerUserDetails
                ? ((TrackerUserDetails) principal).toActor()
                : new Actor(null, event.getAuthentication().getName());
        auditService.log(actor, "LOGIN_SUCCESS", "User logged in: " + actor.username());
    }

    @EventListener
    public void onFailure(AbstractAuthenticationFailureEvent event) {
        Object principal = event.getAuthentication().getPrincipal();
        String username = principal instanceof String ? (String) principal : "Unknown";
        String error = event.getException().getMessage();
        auditService.log(new Actor(null, username), "LOGIN_FAILURE", "Failed login for: " + username + " - " + error);
    }
}
