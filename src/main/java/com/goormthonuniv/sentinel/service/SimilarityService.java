package com.goormthonuniv.sentinel.service;

import com.goormthonuniv.sentinel.util.TextUtils;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Set;

@Service
public class SimilarityService {

    // 토큰 집합 자카드: |A∩B| / |A∪B|, 한쪽이 비면 0
    public double jaccard(String a, String b) {
        Set<String> sa = TextUtils.tokenSet(a);
        Set<String> sb = TextUtils.tokenSet(b);
        if (sa.isEmpty() || sb.isEmpty()) return 0.0;
        Set<String> inter = new HashSet<>(sa);
        inter.retainAll(sb);
        Set<String> union = new HashSet<>(sa);
        union.addAll(sb);
        return (double) inter.size() / union.size();
    }
}
