package com.example.aris.session;

import com.example.aris.source.FeedSource;

/** Creates the {@link FeedSource} a given user's engine should run. */
@FunctionalInterface
public interface FeedSourceProvider {

  FeedSource feedSourceForUser(String userId);
}
