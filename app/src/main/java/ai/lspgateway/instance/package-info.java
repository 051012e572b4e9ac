@NullMarked
package ai.lspgateway.instance;

import org.jspecify.annotations.NullMarked;
