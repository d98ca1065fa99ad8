package com.growpad.core.verify;

import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class CommandAllowlist {

    private final VerificationProperties properties;

    public CommandAllowlist(VerificationProperties properties) {
        this.properties = properties;
    }

    public boolean isAllowed(String command) {
        List<String> allowlist = properties.getAllowedCommands();
        if (command == null || allowlist == null || allowlist.isEmpty()) {
            return false;
        }
        String normalized = command.trim().replaceAll("\\s+", " ");
        for (String pattern : allowlist) {
            if (matches(pattern, normalized)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(String pattern, String command) {
        if (pattern.endsWith("*")) {
            String prefix = pattern.substring(0, pattern.length() - 1);
            return command.startsWith(prefix);
        }
        return pattern.equals(command);
    }
}
