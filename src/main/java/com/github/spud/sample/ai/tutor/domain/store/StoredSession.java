package com.github.spud.sample.ai.tutor.domain.store;

import com.github.spud.sample.ai.tutor.domain.model.TutorSession;

/**
 * 从存储读出的会话及其版本号，会话对象是独立副本
 */
public record StoredSession(TutorSession session, long version) {

}
