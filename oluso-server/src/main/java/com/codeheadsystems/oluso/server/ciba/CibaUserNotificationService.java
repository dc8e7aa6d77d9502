package com.codeheadsystems.oluso.server.ciba;

/**
 * Delivers a backchannel authentication prompt to the user's authentication device
 * (push notification, SMS, e-mail). Implementations live outside the protocol core.
 */
public interface CibaUserNotificationService {

  /**
   * Notifies the user of a pending request. Failures are reported by throwing; the caller logs
   * them and carries on.
   *
   * @param request the pending request
   */
  void notifyUser(CibaRequest request);
}
