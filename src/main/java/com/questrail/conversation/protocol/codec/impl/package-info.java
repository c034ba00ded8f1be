/**
 * Default envelope codec implementations. Callers depend on the interfaces in
 * {@link com.questrail.conversation.protocol.codec}.
 */
package com.questrail.conversation.protocol.codec.impl;
