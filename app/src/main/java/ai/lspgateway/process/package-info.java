@NullMarked
package ai.lspgateway.process;

import org.jspecify.annotations.NullMarked;
