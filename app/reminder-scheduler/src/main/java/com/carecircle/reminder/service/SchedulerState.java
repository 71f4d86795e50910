package com.carecircle.reminder.service;

public enum SchedulerState {
  STOPPED,
  RUNNING
}
