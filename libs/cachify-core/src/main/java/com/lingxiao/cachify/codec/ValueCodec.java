package com.lingxiao.cachify.codec;

import java.lang.reflect.Type;

/**
 * Converts cached results to and from the text stored under a cache key. A null result must
 * round-trip so that a cached null is distinguishable from an absent entry.
 */
public interface ValueCodec {

    String encode(Object value);

    Object decode(String stored, Type type);
}
