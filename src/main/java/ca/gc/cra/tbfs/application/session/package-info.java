/**
 * Session-scoped cluster state, currently the user's home directory used to absolutize paths.
 */
package ca.gc.cra.tbfs.application.session;
