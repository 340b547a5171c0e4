package com.github.spud.sample.ai.agentic.tools;

/**
 * 标记需要按调用方身份授权的工具，注册时由运行时包装为受控工具
 */
public interface GatedCapability {

  String gateCategory();
}
