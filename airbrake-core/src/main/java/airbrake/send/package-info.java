/**
 * Delivery strategies: {@link airbrake.send.SyncSender} posts on the calling thread and
 * {@link airbrake.send.AsyncSender} queues notices for a pool of background workers.
 */
package airbrake.send;
