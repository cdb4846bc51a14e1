package com.scholary.mp3.converter.service;

/** Why a request was rejected before any work started. */
public enum InputErrorCode {
  NO_INPUT,
  AMBIGUOUS_INPUT,
  UNSUPPORTED_REFERENCE,
  FILE_TOO_LARGE,
  UPLOAD_NOT_FOUND
}
