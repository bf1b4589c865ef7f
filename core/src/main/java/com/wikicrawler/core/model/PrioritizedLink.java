package com.wikicrawler.core.model;

/** 우선순위가 매겨진 링크. 값이 작을수록 먼저 확장된다. href는 아직 해석 전. */
public record PrioritizedLink(int priority, String href) {}
