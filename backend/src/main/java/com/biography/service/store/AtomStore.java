package com.biography.service.store;

import com.biography.model.NarrativeAtom;

import java.util.List;

/**
 * 原子存储（外部协作方）
 *
 * 阻塞I/O，流水线不负责重试
 */
public interface AtomStore {

    List<NarrativeAtom> getAtoms(String userId);
}
