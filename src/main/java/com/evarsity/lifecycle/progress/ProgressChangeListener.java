package com.evarsity.lifecycle.progress;

import com.evarsity.lifecycle.progress.ProgressModels.ProgressChanged;

/**
 * Called synchronously inside the transaction that stored the new progress. Throwing aborts that
 * transaction, progress write included.
 */
public interface ProgressChangeListener {
    void onProgressChanged(ProgressChanged event);
}
