package com.example.aris.service;

import com.example.aris.model.FeedResult;

/** Receives every feed result the engine delivers after reactive or periodic refreshes. */
@FunctionalInterface
public interface FeedSubscriber {

  void onFeed(FeedResult result);
}
