package com.example.tieredcache.domain;

import java.io.Serializable;

/**
 * 웜업 대상 엔티티. 캐시 키의 id 부분을 제공한다
 */
public interface CacheableEntity extends Serializable {

    String cacheId();
}
