package com.acme.dispatch.command;

/** Inbound channel a command arrived on. */
public enum Transport {
  HTTP,
  QUEUE,
  STREAM
}
