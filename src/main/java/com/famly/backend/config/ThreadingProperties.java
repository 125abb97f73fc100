package com.famly.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "famly.threads")
public class ThreadingProperties {

    /** When true, only the creator and members of a thread may post into it. */
    private boolean requireMembershipToPost = false;

    /** Attempts for a compare-and-swap removal from a thread list before giving up. */
    private int maxUpdateRetries = 3;

    private int maxTitleLength = 200;

    public boolean isRequireMembershipToPost() {
        return requireMembershipToPost;
    }

    public void setRequireMembershipToPost(boolean requireMembershipToPost) {
        this.requireMembershipToPost = requireMembershipToPost;
    }

    public int getMaxUpdateRetries() {
        return maxUpdateRetries;
    }

    public void setMaxUpdateRetries(int maxUpdateRetries) {
        this.maxUpdateRetries = maxUpdateRetries;
    }

    public int getMaxTitleLength() {
        return maxTitleLength;
    }

    public void setMaxTitleLength(int maxTitleLength) {
        this.maxTitleLength = maxTitleLength;
    }
}
