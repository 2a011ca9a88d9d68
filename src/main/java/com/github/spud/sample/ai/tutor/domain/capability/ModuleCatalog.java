package com.github.spud.sample.ai.tutor.domain.capability;

import java.util.Optional;

/**
 * 模块与学习目标来源
 */
public interface ModuleCatalog {

  /**
   * 按 id 查找模块，目标按来源顺序返回
   */
  Optional<CourseModule> findModule(String moduleId);
}
