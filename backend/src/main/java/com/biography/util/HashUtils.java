package com.biography.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * 来源追溯用的摘要工具
 */
public final class HashUtils {

    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        return DigestUtils.sha256Hex(value != null ? value : "");
    }

    /**
     * 原子集合快照摘要：id 排序后以逗号拼接再取 SHA-256，与顺序无关
     */
    public static String snapshotHash(Collection<String> atomIds) {
        List<String> sorted = new ArrayList<>(atomIds);
        Collections.sort(sorted);
        return sha256Hex(String.join(",", sorted));
    }
}
