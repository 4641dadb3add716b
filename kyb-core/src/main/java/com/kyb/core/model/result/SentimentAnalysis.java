package com.kyb.core.model.result;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SentimentAnalysis(
    @JsonProperty("analyzed_tweet_count") int analyzedTweetCount,
    @JsonProperty("sentiment_summary") SentimentSummary sentimentSummary,
    @JsonProperty("topic") String topic,
    @JsonProperty("customer_id") String customerId,
    @JsonProperty("status") String status
) {}
