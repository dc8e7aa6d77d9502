package com.codeheadsystems.oluso.server.policy;

/**
 * What a journey is for. Authentication flows come first, then data collection flows that need
 * no signed-in user.
 */
public enum JourneyType {
  SIGN_IN,
  SIGN_UP,
  SIGN_IN_SIGN_UP,
  PASSWORD_RESET,
  PROFILE_EDIT,
  LINK_ACCOUNT,
  CONSENT,
  WAITLIST,
  CONTACT_FORM,
  SURVEY,
  FEEDBACK,
  DATA_COLLECTION,
  CUSTOM
}
