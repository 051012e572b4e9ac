@NullMarked
package ai.lspgateway.rpc;

import org.jspecify.annotations.NullMarked;
