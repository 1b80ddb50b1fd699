package com.goormthonuniv.sentinel.feed;

import java.io.IOException;
import java.time.Duration;

/** URL의 렌더링된 본문 텍스트를 가져온다. */
public interface PageFetcher {
    String fetchText(String url, Duration timeout) throws IOException;
}
