package com.market.pulse.enricher.bus;

import com.market.pulse.enricher.common.Result;

import java.util.function.Consumer;

/**
 * Publish/subscribe transport for raw JSON payloads.
 *
 * Contracts:
 *  - publish(...) never throws; success carries the number of subscribers that received the
 *    message (0 is still a success), transport failures come back as a failed Result.
 *  - subscribe(...) delivers one payload at a time per subscription, in arrival order.
 *    A handler that throws is logged and the subscription keeps running.
 */
public interface EventBus {

    Result<Long> publish(String channel, String payload);

    Subscription subscribe(String channel, Consumer<String> handler);
}
