package com.github.spud.sample.ai.tutor.domain.error;

public class ModuleNotFoundException extends TutorException {

  public ModuleNotFoundException(String moduleId) {
    super("Module not found: " + moduleId);
  }
}
