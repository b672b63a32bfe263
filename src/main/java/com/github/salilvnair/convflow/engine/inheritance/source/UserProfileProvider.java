package com.github.salilvnair.convflow.engine.inheritance.source;

public interface UserProfileProvider {
    UserProfile profile(String userId);
}
